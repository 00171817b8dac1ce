package com.huntflow.domain.extraction.model.valobj;

/**
 * QA 复核结论：pass 为接受，其它一律视为驳回并携带反馈。
 */
public record QaVerdict(boolean pass, String verdict, String feedback) {

    public static final String PASS = "pass";
    public static final String NEEDS_REVISION = "needs_revision";
    public static final String CRITICAL_FAILURE = "critical_failure";

    public static QaVerdict accepted(String feedback) {
        return new QaVerdict(true, PASS, feedback);
    }

    public static QaVerdict rejected(String verdict, String feedback) {
        return new QaVerdict(false, verdict == null ? NEEDS_REVISION : verdict, feedback);
    }
}
