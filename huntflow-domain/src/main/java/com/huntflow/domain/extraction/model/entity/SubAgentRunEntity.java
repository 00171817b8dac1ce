package com.huntflow.domain.extraction.model.entity;

import com.huntflow.domain.extraction.model.valobj.Observable;
import com.huntflow.domain.extraction.model.valobj.SubAgentOutcome;
import com.huntflow.domain.extraction.model.valobj.SubAgentSpec;
import com.huntflow.types.enums.SubAgentStatusEnum;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 子代理运行实体：单个子代理的本地状态机。
 * <p>
 * pending → generating → (qaEnabled) reviewing → retry → generating … → done | failed。
 * 只在所属工作线程内修改，不跨线程共享。
 * </p>
 */
@Data
public class SubAgentRunEntity {

    private SubAgentSpec spec;

    private SubAgentStatusEnum status;

    /**
     * 已开始的生成次数
     */
    private int attempts;

    private int maxAttempts;

    /**
     * 上一轮反馈，拼入下一次生成提示词
     */
    private String feedback;

    /**
     * 当前采纳的候选
     */
    private List<Observable> accepted;

    /**
     * 目前为止最好的候选（数量最多，同数量取最早）
     */
    private List<Observable> bestCandidates;

    private int bestAttempt;

    private boolean qaExhausted;

    private List<String> warnings = new ArrayList<>();

    private String errorType;

    private String errorMessage;

    public static SubAgentRunEntity create(SubAgentSpec spec, int maxAttempts) {
        SubAgentRunEntity run = new SubAgentRunEntity();
        run.setSpec(spec);
        run.setStatus(SubAgentStatusEnum.PENDING);
        run.setMaxAttempts(Math.max(maxAttempts, 1));
        return run;
    }

    public static SubAgentRunEntity skipped(SubAgentSpec spec) {
        SubAgentRunEntity run = new SubAgentRunEntity();
        run.setSpec(spec);
        run.setStatus(SubAgentStatusEnum.SKIPPED);
        run.getWarnings().add("skipped: disabled by config");
        return run;
    }

    public boolean hasAttemptsLeft() {
        return attempts < maxAttempts;
    }

    /**
     * 开始一次生成
     */
    public int beginGeneration() {
        if (status != SubAgentStatusEnum.PENDING && status != SubAgentStatusEnum.RETRY) {
            throw new IllegalStateException("Sub-agent cannot generate from status: " + status);
        }
        if (!hasAttemptsLeft()) {
            throw new IllegalStateException("Sub-agent attempts exhausted: " + spec.getName());
        }
        attempts++;
        status = SubAgentStatusEnum.GENERATING;
        return attempts;
    }

    /**
     * 记录本轮候选并更新最好结果
     */
    public void recordCandidates(List<Observable> candidates) {
        if (status != SubAgentStatusEnum.GENERATING) {
            throw new IllegalStateException("Candidates can only be recorded while generating");
        }
        List<Observable> safe = candidates == null ? List.of() : candidates;
        if (bestCandidates == null || safe.size() > bestCandidates.size()) {
            bestCandidates = new ArrayList<>(safe);
            bestAttempt = attempts;
        }
    }

    public void beginReview() {
        if (status != SubAgentStatusEnum.GENERATING) {
            throw new IllegalStateException("Sub-agent cannot review from status: " + status);
        }
        status = SubAgentStatusEnum.REVIEWING;
    }

    /**
     * 本轮未通过（输出无法解析或 QA 驳回），等待下一次生成
     */
    public void requestRetry(String feedback) {
        if (status != SubAgentStatusEnum.GENERATING && status != SubAgentStatusEnum.REVIEWING) {
            throw new IllegalStateException("Sub-agent cannot retry from status: " + status);
        }
        this.feedback = feedback;
        status = SubAgentStatusEnum.RETRY;
    }

    public void accept(List<Observable> candidates) {
        if (status != SubAgentStatusEnum.GENERATING && status != SubAgentStatusEnum.REVIEWING) {
            throw new IllegalStateException("Sub-agent cannot accept from status: " + status);
        }
        accepted = candidates == null ? new ArrayList<>() : new ArrayList<>(candidates);
        status = SubAgentStatusEnum.DONE;
    }

    /**
     * 次数用尽：有候选时以最好结果完成并标记 qaExhausted，否则失败
     */
    public void exhaust() {
        if (status != SubAgentStatusEnum.RETRY) {
            throw new IllegalStateException("Sub-agent cannot exhaust from status: " + status);
        }
        if (bestCandidates == null) {
            fail("invalid_response", "no parseable output after " + attempts + " attempts");
            return;
        }
        accepted = new ArrayList<>(bestCandidates);
        qaExhausted = true;
        warnings.add("qa_exhausted: using attempt " + bestAttempt);
        status = SubAgentStatusEnum.DONE;
    }

    public void fail(String errorType, String errorMessage) {
        if (status != null && status.isTerminal()) {
            throw new IllegalStateException("Sub-agent already finished: " + status);
        }
        this.errorType = errorType;
        this.errorMessage = errorMessage;
        status = SubAgentStatusEnum.FAILED;
    }

    public void addWarning(String warning) {
        warnings.add(warning);
    }

    public SubAgentOutcome toOutcome() {
        SubAgentOutcome outcome = new SubAgentOutcome();
        outcome.setAgentName(spec.getName());
        outcome.setObservableType(spec.getObservableType());
        outcome.setStatus(status);
        outcome.setAttempts(attempts);
        outcome.setQaExhausted(qaExhausted);
        outcome.setObservables(status == SubAgentStatusEnum.DONE && accepted != null
                ? new ArrayList<>(accepted) : new ArrayList<>());
        outcome.setWarnings(new ArrayList<>(warnings));
        outcome.setErrorType(errorType);
        outcome.setErrorMessage(errorMessage);
        return outcome;
    }
}
