package com.huntflow.domain.rule.service;

import com.huntflow.domain.rule.model.entity.RuleDraftEntity;
import com.huntflow.domain.rule.model.valobj.RuleSections;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;

/**
 * 规则分段归一化：标题、描述、标签与检测签名。
 * <p>
 * 签名 = 排序后的日志源 key:value + 排序去重且去掉修饰符的检测字段名 (CommandLine|contains → CommandLine)。
 * </p>
 */
@Service
public class RuleSectionDomainService {

    public RuleSections sections(RuleDraftEntity draft) {
        return sections(draft.getTitle(), draft.getDescription(), draft.getTags(),
                draft.getLogSource(), draft.getDetection());
    }

    public RuleSections sections(String title, String description, List<String> tags,
                                 Map<String, Object> logSource, Map<String, Object> detection) {
        return new RuleSections(
                StringUtils.trimToEmpty(title),
                StringUtils.trimToEmpty(description),
                normalizeTags(tags),
                signature(logSource, detection));
    }

    String normalizeTags(List<String> tags) {
        if (tags == null || tags.isEmpty()) {
            return "";
        }
        TreeSet<String> normalized = new TreeSet<>();
        for (String tag : tags) {
            if (StringUtils.isNotBlank(tag)) {
                normalized.add(tag.trim().toLowerCase(Locale.ROOT));
            }
        }
        return String.join(" ", normalized);
    }

    String signature(Map<String, Object> logSource, Map<String, Object> detection) {
        TreeSet<String> sourcePairs = new TreeSet<>();
        if (logSource != null) {
            logSource.forEach((key, value) -> {
                if (value != null && StringUtils.isNotBlank(String.valueOf(value))) {
                    sourcePairs.add(key.toLowerCase(Locale.ROOT) + ":" + String.valueOf(value).toLowerCase(Locale.ROOT));
                }
            });
        }
        TreeSet<String> fields = new TreeSet<>();
        if (detection != null) {
            detection.forEach((key, value) -> {
                if (!"condition".equals(key) && !"timeframe".equals(key)) {
                    collectFields(value, fields);
                }
            });
        }
        List<String> parts = new ArrayList<>(sourcePairs);
        parts.addAll(fields);
        return String.join(" ", parts);
    }

    private void collectFields(Object selection, TreeSet<String> fields) {
        if (selection instanceof Map<?, ?> map) {
            for (Object key : map.keySet()) {
                String field = String.valueOf(key);
                int modifier = field.indexOf('|');
                String name = modifier >= 0 ? field.substring(0, modifier) : field;
                if (StringUtils.isNotBlank(name)) {
                    fields.add(name.trim());
                }
            }
        } else if (selection instanceof List<?> list) {
            for (Object item : list) {
                collectFields(item, fields);
            }
        }
    }
}
