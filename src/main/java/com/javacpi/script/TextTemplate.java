package com.javacpi.script;

import com.javacpi.schema.ValidatedArguments;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Script text with {@code {{name}}} placeholders replaced by PowerShell literals.
 */
public final class TextTemplate implements ScriptTemplate {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{([a-z][a-z0-9_]*)}}");

    private final String text;
    private final Set<String> placeholders;

    public TextTemplate(String text) {
        this.text = text;
        var names = new LinkedHashSet<String>();
        var m = PLACEHOLDER.matcher(text);
        while (m.find()) {
            names.add(m.group(1));
        }
        this.placeholders = Set.copyOf(names);
    }

    @Override
    public String render(ValidatedArguments args) {
        var m = PLACEHOLDER.matcher(text);
        var sb = new StringBuilder(text.length() + 64);
        while (m.find()) {
            var literal = PowerShellLiteral.of(args.get(m.group(1)));
            m.appendReplacement(sb, Matcher.quoteReplacement(literal));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    @Override
    public Set<String> placeholders() {
        return placeholders;
    }

    public String text() { return text; }

    @Override
    public String toString() {
        return text;
    }
}
