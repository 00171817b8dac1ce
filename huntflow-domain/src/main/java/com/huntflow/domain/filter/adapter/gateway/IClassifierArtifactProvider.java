package com.huntflow.domain.filter.adapter.gateway;

import java.util.Optional;

/**
 * 分类器产物提供方。
 */
public interface IClassifierArtifactProvider {

    /**
     * 当前分类器；不可用时返回 empty（过滤降级放行）。
     *
     * @throws com.huntflow.types.exception.FatalConfigurationException 产物存在但已损坏
     */
    Optional<IClassifierArtifact> current();
}
