package com.insightbi.platform.service.audit;

import com.insightbi.common.security.SecurityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Records administrative actions to the dedicated {@code insight.audit} logger.
 */
@Service
public class AuditService {

    private static final Logger AUDIT = LoggerFactory.getLogger("insight.audit");
    private static final int TARGET_MAX_LENGTH = 160;

    public void audit(String action, String module, String target) {
        String actor = SecurityUtils.getCurrentUserLogin().orElse("anonymous");
        AUDIT.info("actor={} action={} module={} target={}", actor, action, module, sanitize(target));
    }

    private String sanitize(String message) {
        if (!StringUtils.hasText(message)) {
            return "";
        }
        String cleaned = message.replaceAll("[\\r\\n]+", " ").trim();
        return cleaned.length() > TARGET_MAX_LENGTH ? cleaned.substring(0, TARGET_MAX_LENGTH) : cleaned;
    }
}
