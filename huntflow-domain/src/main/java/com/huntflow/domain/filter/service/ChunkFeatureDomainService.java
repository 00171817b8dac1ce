package com.huntflow.domain.filter.service;

import com.huntflow.domain.filter.model.valobj.ChunkFeatures;
import com.huntflow.types.exception.FatalConfigurationException;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * 分块特征抽取与模式匹配。编译后的正则按原文缓存，无其它可变状态。
 */
@Service
public class ChunkFeatureDomainService {

    private static final Pattern TOKEN = Pattern.compile("[a-z0-9_]+");

    private final Map<String, Pattern> patternCache = new ConcurrentHashMap<>();

    public ChunkFeatures extract(String chunk, List<String> huntablePatterns, List<String> notHuntablePatterns) {
        Map<String, Integer> counts = new HashMap<>();
        int total = 0;
        Matcher matcher = TOKEN.matcher(chunk.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            counts.merge(matcher.group(), 1, Integer::sum);
            total++;
        }
        return new ChunkFeatures(counts, total,
                countHits(chunk, huntablePatterns),
                countHits(chunk, notHuntablePatterns));
    }

    public boolean matchesAny(String chunk, List<String> patterns) {
        if (patterns == null) {
            return false;
        }
        for (String pattern : patterns) {
            if (compile(pattern).matcher(chunk).find()) {
                return true;
            }
        }
        return false;
    }

    private int countHits(String chunk, List<String> patterns) {
        if (patterns == null) {
            return 0;
        }
        int hits = 0;
        for (String pattern : patterns) {
            Matcher matcher = compile(pattern).matcher(chunk);
            while (matcher.find()) {
                hits++;
            }
        }
        return hits;
    }

    private Pattern compile(String pattern) {
        return patternCache.computeIfAbsent(pattern, key -> {
            try {
                return Pattern.compile(key, Pattern.CASE_INSENSITIVE);
            } catch (PatternSyntaxException ex) {
                throw new FatalConfigurationException("Invalid filter pattern: " + key, ex);
            }
        });
    }
}
