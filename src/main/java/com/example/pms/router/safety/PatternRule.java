package com.example.pms.router.safety;

import java.util.regex.Pattern;

/**
 * A named regular-expression rule. The name is reported as the matched rule of a lane decision.
 */
public record PatternRule(String group, String name, Pattern pattern) {

    public boolean matches(String text) {
        return pattern.matcher(text).find();
    }

    /** Qualified name, e.g. {@code paste_dump:log_timestamp}. */
    public String qualifiedName() {
        return group + ":" + name;
    }
}
