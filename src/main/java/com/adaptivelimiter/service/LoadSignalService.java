package com.adaptivelimiter.service;

import com.adaptivelimiter.model.SystemLoad;
import com.adaptivelimiter.model.UserBehavior;
import com.adaptivelimiter.store.CounterStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Map;

/**
 * Behavior and load signals kept in the counter store. Written by an external monitor,
 * read by adaptive checks. Missing fields fall back to defaults; read failures do too.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LoadSignalService {

    static final String BEHAVIOR_PREFIX = "behavior:";
    static final String SYSTEM_LOAD_KEY = "system:load";
    static final Duration BEHAVIOR_TTL = Duration.ofHours(24);
    static final Duration SYSTEM_LOAD_TTL = Duration.ofMinutes(5);

    private final CounterStore counterStore;

    public UserBehavior getUserBehavior(String identity) {
        try {
            Map<String, String> fields = counterStore.getHash(BEHAVIOR_PREFIX + identity);
            return UserBehavior.fromFields(fields).withDefaults(UserBehavior.defaults());
        } catch (Exception e) {
            log.error("Failed to read user behavior for {}, using defaults", identity, e);
            return UserBehavior.defaults();
        }
    }

    public SystemLoad getSystemLoad() {
        try {
            Map<String, String> fields = counterStore.getHash(SYSTEM_LOAD_KEY);
            return SystemLoad.fromFields(fields).withDefaults(SystemLoad.defaults());
        } catch (Exception e) {
            log.error("Failed to read system load, using defaults", e);
            return SystemLoad.defaults();
        }
    }

    // only the fields present in the update are written
    public void updateUserBehavior(String identity, UserBehavior update) {
        Map<String, String> fields = update.toFields();
        if (fields.isEmpty()) {
            return;
        }
        counterStore.putHash(BEHAVIOR_PREFIX + identity, fields, BEHAVIOR_TTL);
        log.info("Updated user behavior for {}: {}", identity, fields.keySet());
    }

    public void updateSystemLoad(SystemLoad update) {
        Map<String, String> fields = update.toFields();
        if (fields.isEmpty()) {
            return;
        }
        counterStore.putHash(SYSTEM_LOAD_KEY, fields, SYSTEM_LOAD_TTL);
        log.debug("Updated system load: {}", fields);
    }
}
