package com.phillippitts.voicecompanion.presentation.security;

import com.phillippitts.voicecompanion.config.properties.FollowProperties;
import com.phillippitts.voicecompanion.exception.OwnerOnlyException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

/**
 * Restricts control endpoints to the configured owner ({@code X-User-ID} header).
 */
@Component
public class OwnerGuard {

    public static final String USER_ID_HEADER = "X-User-ID";

    private static final Logger LOG = LogManager.getLogger(OwnerGuard.class);

    private final FollowProperties props;

    public OwnerGuard(FollowProperties props) {
        this.props = props;
    }

    /**
     * @throws OwnerOnlyException when {@code userId} is missing or not the owner
     */
    public void requireOwner(String userId) {
        if (!props.isOwner(userId)) {
            LOG.warn("Rejected control request from user {}", userId == null ? "<none>" : userId);
            throw new OwnerOnlyException();
        }
    }
}
