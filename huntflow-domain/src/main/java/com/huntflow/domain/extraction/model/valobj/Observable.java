package com.huntflow.domain.extraction.model.valobj;

import com.huntflow.types.enums.ObservableTypeEnum;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * 抽取出的可观测项。
 */
@Value
@Builder
@Jacksonized
public class Observable {

    ObservableTypeEnum type;

    String value;

    /**
     * 原文中的引用片段
     */
    String sourceReference;
}
