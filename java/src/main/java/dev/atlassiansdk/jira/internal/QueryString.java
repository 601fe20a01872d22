package dev.atlassiansdk.jira.internal;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Ordered query parameter accumulator. Blank values are skipped, so optional parameters are only sent when set.
 */
public final class QueryString {

    private final List<String[]> params = new ArrayList<>();

    public QueryString add(String key, String value) {
        Objects.requireNonNull(key, "key");
        if (value != null && !value.isBlank()) {
            params.add(new String[] {key, value});
        }
        return this;
    }

    public QueryString add(String key, int value) {
        return add(key, Integer.toString(value));
    }

    /**
     * Adds {@code key=true} when the flag is set; nothing otherwise.
     */
    public QueryString flag(String key, boolean enabled) {
        return enabled ? add(key, "true") : this;
    }

    /**
     * Adds one {@code key=value} pair per element.
     */
    public QueryString addEach(String key, Collection<String> values) {
        if (values != null) {
            for (String value : values) {
                add(key, value);
            }
        }
        return this;
    }

    /**
     * Adds a single parameter whose value is the comma separated list of elements.
     */
    public QueryString addJoined(String key, Collection<String> values) {
        if (values == null || values.isEmpty()) {
            return this;
        }
        List<String> kept = new ArrayList<>();
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                kept.add(value.trim());
            }
        }
        return add(key, String.join(",", kept));
    }

    public boolean isEmpty() {
        return params.isEmpty();
    }

    public String encode() {
        StringBuilder out = new StringBuilder();
        for (String[] param : params) {
            if (out.length() > 0) {
                out.append('&');
            }
            out.append(URLEncoder.encode(param[0], StandardCharsets.UTF_8))
                .append('=')
                .append(URLEncoder.encode(param[1], StandardCharsets.UTF_8));
        }
        return out.toString();
    }

    /**
     * @return {@code path} followed by {@code ?query} when any parameter was added, {@code path} otherwise.
     */
    public String appendTo(String path) {
        return isEmpty() ? path : path + "?" + encode();
    }

    @Override
    public String toString() {
        return encode();
    }
}
