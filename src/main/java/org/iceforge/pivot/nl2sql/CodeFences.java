package org.iceforge.pivot.nl2sql;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Markdown code fences in model output.
 */
public final class CodeFences {

    private static final Pattern ANY_FENCE =
            Pattern.compile("```(?:[A-Za-z0-9_+-]*[ \\t]*\\R)?(.*?)```", Pattern.DOTALL);

    private CodeFences() {
    }

    /**
     * Body of the first non-empty fence tagged {@code language}, else of the first non-empty
     * fence of any kind, else null.
     */
    public static String firstBlock(String text, String language) {
        Pattern tagged = Pattern.compile("```[ \\t]*" + Pattern.quote(language.toLowerCase(Locale.ROOT))
                + "[ \\t]*\\R(.*?)```", Pattern.DOTALL | Pattern.CASE_INSENSITIVE);
        String body = first(tagged, text);
        return body != null ? body : first(ANY_FENCE, text);
    }

    /**
     * The text with every fence marker removed.
     */
    public static String strip(String text) {
        return text.replace("```", "");
    }

    private static String first(Pattern fence, String text) {
        Matcher m = fence.matcher(text);
        while (m.find()) {
            String body = m.group(1).trim();
            if (!body.isEmpty()) {
                return body;
            }
        }
        return null;
    }
}
