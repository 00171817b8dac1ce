package com.huntflow.domain.analysis.service;

import com.huntflow.domain.agent.model.valobj.AgentReply;
import com.huntflow.domain.agent.service.AgentInvocationDomainService;
import com.huntflow.domain.analysis.model.valobj.PlatformDetectionResult;
import com.huntflow.domain.workflow.model.valobj.AgentInvocationContext;
import com.huntflow.domain.workflow.model.valobj.WorkflowConfig;
import com.huntflow.domain.workflow.service.ExecutionAuditDomainService;
import com.huntflow.types.enums.PlatformEnum;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 平台检测领域服务：关键词/模式确定性分类，无关键词证据时可走模型兜底。
 */
@Service
public class PlatformDetectionDomainService {

    public static final String FALLBACK_AGENT_NAME = "OSDetectionFallback";

    private static final String FALLBACK_PROMPT = """
            Determine which operating system the described behaviors target (Windows, Linux, MacOS, or multiple). \
            Output one label only.

            Content:
            %s

            Output only the OS label: Windows, Linux, MacOS, or multiple""";

    private static final Map<PlatformEnum, List<Pattern>> INDICATORS = new EnumMap<>(PlatformEnum.class);

    static {
        INDICATORS.put(PlatformEnum.WINDOWS, compile(
                "\\bpowershell(\\.exe)?\\b", "\\bcmd\\.exe\\b", "\\bwmic(\\.exe)?\\b", "\\breg\\.exe\\b",
                "\\bschtasks(\\.exe)?\\b", "\\brundll32(\\.exe)?\\b", "\\bHKLM\\b", "\\bHKCU\\b", "\\bHKEY_",
                "[a-z]:\\\\", "%appdata%", "%temp%", "%systemroot%", "\\bsysmon\\b",
                "\\bevent ?id\\s*:?\\s*4[0-9]{3}\\b", "\\.(exe|dll|bat|ps1)\\b", "\\bwindows\\b"));
        INDICATORS.put(PlatformEnum.LINUX, compile(
                "\\bbash\\b", "\\bsystemctl\\b", "\\bsystemd\\b", "\\bcrontab\\b", "\\bapt(-get)?\\b",
                "\\byum\\b", "\\bdpkg\\b", "\\brpm\\b", "/etc/", "/var/", "/tmp/", "/usr/bin/",
                "\\binit\\.d\\b", "\\.(sh|deb)\\b", "\\blinux\\b"));
        INDICATORS.put(PlatformEnum.MACOS, compile(
                "\\bosascript\\b", "\\blaunchctl\\b", "\\bplutil\\b", "/Library/", "/Applications/",
                "\\bLaunchAgents\\b", "\\bLaunchDaemons\\b", "\\.(pkg|dmg)\\b", "\\bmacos\\b", "\\bmac os\\b",
                "\\bosx\\b"));
    }

    private final AgentInvocationDomainService agentInvocationDomainService;
    private final ExecutionAuditDomainService executionAuditDomainService;

    public PlatformDetectionDomainService(AgentInvocationDomainService agentInvocationDomainService,
                                          ExecutionAuditDomainService executionAuditDomainService) {
        this.agentInvocationDomainService = agentInvocationDomainService;
        this.executionAuditDomainService = executionAuditDomainService;
    }

    public PlatformDetectionResult detect(AgentInvocationContext context, String text, List<String> platformHints) {
        Map<PlatformEnum, Integer> scores = score(text, platformHints);
        PlatformEnum keywordLabel = classify(scores, context.getConfig().getPlatformMultipleRatio());
        Map<String, Integer> scoreView = new LinkedHashMap<>();
        scores.forEach((platform, value) -> scoreView.put(platform.getCode(), value));
        if (keywordLabel != PlatformEnum.UNKNOWN || !context.getConfig().isPlatformFallbackEnabled()) {
            String method = keywordLabel == PlatformEnum.UNKNOWN
                    ? PlatformDetectionResult.METHOD_NONE : PlatformDetectionResult.METHOD_KEYWORD;
            return new PlatformDetectionResult(keywordLabel, method, scoreView, null);
        }
        String prompt = String.format(FALLBACK_PROMPT, text);
        AgentReply reply = agentInvocationDomainService.invoke(context, FALLBACK_AGENT_NAME, 1, prompt);
        PlatformEnum label = parseLabel(reply.getText());
        executionAuditDomainService.recordReply(context, reply, label != PlatformEnum.UNKNOWN, "label=" + label.getCode());
        return new PlatformDetectionResult(label, PlatformDetectionResult.METHOD_MODEL_FALLBACK, scoreView,
                truncate(reply.getText(), 200));
    }

    /**
     * 是否因目标平台集合而终止
     */
    public boolean isExcluded(PlatformEnum detected, WorkflowConfig config) {
        List<PlatformEnum> targets = config.getTargetPlatforms();
        if (targets == null || targets.isEmpty() || detected == PlatformEnum.MULTIPLE) {
            return false;
        }
        return !targets.contains(detected);
    }

    Map<PlatformEnum, Integer> score(String text, List<String> platformHints) {
        Map<PlatformEnum, Integer> scores = new EnumMap<>(PlatformEnum.class);
        String safeText = text == null ? "" : text;
        for (Map.Entry<PlatformEnum, List<Pattern>> entry : INDICATORS.entrySet()) {
            int hits = 0;
            for (Pattern pattern : entry.getValue()) {
                Matcher matcher = pattern.matcher(safeText);
                while (matcher.find()) {
                    hits++;
                }
            }
            scores.put(entry.getKey(), hits);
        }
        if (platformHints != null) {
            for (String hint : platformHints) {
                PlatformEnum platform = parseHint(hint);
                if (platform != null && platform.isConcrete()) {
                    scores.merge(platform, 1, Integer::sum);
                }
            }
        }
        return scores;
    }

    PlatformEnum classify(Map<PlatformEnum, Integer> scores, double multipleRatio) {
        int top = scores.values().stream().mapToInt(Integer::intValue).max().orElse(0);
        if (top <= 0) {
            return PlatformEnum.UNKNOWN;
        }
        List<PlatformEnum> contenders = new ArrayList<>();
        for (Map.Entry<PlatformEnum, Integer> entry : scores.entrySet()) {
            if (entry.getValue() > 0 && entry.getValue() >= top * multipleRatio) {
                contenders.add(entry.getKey());
            }
        }
        if (contenders.size() > 1) {
            return PlatformEnum.MULTIPLE;
        }
        return contenders.get(0);
    }

    PlatformEnum parseLabel(String response) {
        if (response == null) {
            return PlatformEnum.UNKNOWN;
        }
        String lower = response.toLowerCase(Locale.ROOT);
        boolean windows = lower.contains("windows");
        boolean linux = lower.contains("linux");
        boolean mac = lower.contains("macos") || lower.contains("mac os");
        boolean multiple = lower.contains("multiple");
        if (multiple) {
            return PlatformEnum.MULTIPLE;
        }
        int named = (windows ? 1 : 0) + (linux ? 1 : 0) + (mac ? 1 : 0);
        if (named > 1) {
            return PlatformEnum.MULTIPLE;
        }
        if (windows) {
            return PlatformEnum.WINDOWS;
        }
        if (linux) {
            return PlatformEnum.LINUX;
        }
        if (mac) {
            return PlatformEnum.MACOS;
        }
        return PlatformEnum.UNKNOWN;
    }

    private PlatformEnum parseHint(String hint) {
        if (hint == null || hint.isBlank()) {
            return null;
        }
        try {
            return PlatformEnum.fromCode(hint);
        } catch (IllegalArgumentException ex) {
            return null;
        }
    }

    private static List<Pattern> compile(String... regexes) {
        List<Pattern> patterns = new ArrayList<>(regexes.length);
        for (String regex : regexes) {
            patterns.add(Pattern.compile(regex, Pattern.CASE_INSENSITIVE));
        }
        return patterns;
    }

    private String truncate(String text, int maxLength) {
        if (text == null || text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength);
    }
}
