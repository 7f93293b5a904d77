package com.agentdispatch.core.events;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Wildcard topic matching: {@code *} matches any run of characters, dots included, so
 * {@code task.*} matches {@code task.TASK-001} and a bare {@code *} matches every topic.
 */
public final class TopicMatcher {

    private static final Map<String, Pattern> CACHE = new ConcurrentHashMap<>();

    private TopicMatcher() {}

    public static boolean matches(String pattern, String topic) {
        if ("*".equals(pattern)) {
            return true;
        }
        if (pattern.indexOf('*') < 0) {
            return pattern.equals(topic);
        }
        return CACHE.computeIfAbsent(pattern, TopicMatcher::compile).matcher(topic).matches();
    }

    static Pattern compile(String pattern) {
        var regex = new StringBuilder();
        int start = 0;
        int star;
        while ((star = pattern.indexOf('*', start)) >= 0) {
            regex.append(Pattern.quote(pattern.substring(start, star))).append(".*");
            start = star + 1;
        }
        regex.append(Pattern.quote(pattern.substring(start)));
        return Pattern.compile(regex.toString());
    }
}
