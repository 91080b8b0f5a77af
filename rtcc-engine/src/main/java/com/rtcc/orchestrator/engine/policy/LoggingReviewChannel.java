package com.rtcc.orchestrator.engine.policy;

import com.rtcc.orchestrator.core.model.GuardrailCheck;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Review channel that writes flagged checks to a dedicated logger.
 */
public class LoggingReviewChannel implements ReviewChannel {

    private static final Logger log = LoggerFactory.getLogger("rtcc.policy.review");

    private final AtomicLong flagged = new AtomicLong();

    @Override
    public void flag(GuardrailCheck check, PolicyContext context) {
        flagged.incrementAndGet();
        log.warn("Review required: binding={} type={} workflow={} action={} ({}) violations={} recommendations={}",
            check.bindingName(), check.policyType(), context.workflowId(),
            context.actionType(), context.actionId(), check.violations(), check.recommendations());
    }

    public long flaggedCount() {
        return flagged.get();
    }
}
