package com.huntflow.domain.rule.model.valobj;

import com.huntflow.types.enums.RuleSectionEnum;
import lombok.Value;

import java.util.EnumMap;
import java.util.Map;

/**
 * 规则的四段归一化文本，作为嵌入输入。
 */
@Value
public class RuleSections {

    String title;
    String description;
    String tags;
    String signature;

    public Map<RuleSectionEnum, String> asMap() {
        Map<RuleSectionEnum, String> map = new EnumMap<>(RuleSectionEnum.class);
        map.put(RuleSectionEnum.TITLE, title);
        map.put(RuleSectionEnum.DESCRIPTION, description);
        map.put(RuleSectionEnum.TAGS, tags);
        map.put(RuleSectionEnum.SIGNATURE, signature);
        return map;
    }
}
