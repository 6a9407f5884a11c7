package com.sourcebundler.core.marker;

import com.sourcebundler.core.model.Marker;
import com.sourcebundler.core.model.MarkerKind;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds and recognizes marker lines:
 * <pre>
 * &lt;leader&gt; [[ SCB ]] &lt;KEYWORD&gt;: &lt;value&gt;&lt;suffix&gt;
 * </pre>
 * Recognition keys on the sentinel and keyword only. Any non-whitespace token is
 * accepted as the leader, since a bundle may be re-bundled under another comment
 * convention.
 */
@Component
public class MarkerCodec {

    public static final String SENTINEL = "[[ SCB ]]";

    private static final Pattern MARKER_PATTERN = Pattern.compile(
            "^(\\S+)\\s+" + Pattern.quote(SENTINEL)
                    + " (START FILE|END FILE|START ERROR|ERROR START|END ERROR|ERROR END|ERROR):\\s+(.+?)(\\s*\\*/)?$");

    public String format(MarkerKind kind, CommentSyntax syntax, String value) {
        return syntax.leader() + " " + SENTINEL + " " + kind.keyword() + ": " + value + syntax.closingSuffix();
    }

    public String startFile(CommentSyntax syntax, String displayPath) {
        return format(MarkerKind.START_FILE, syntax, displayPath);
    }

    public String endFile(CommentSyntax syntax, String displayPath) {
        return format(MarkerKind.END_FILE, syntax, displayPath);
    }

    public String startError(CommentSyntax syntax, String displayPath) {
        return format(MarkerKind.START_ERROR, syntax, displayPath);
    }

    /**
     * Line breaks inside the message are folded to spaces so the error stays on one line.
     */
    public String errorMessage(CommentSyntax syntax, String message) {
        return format(MarkerKind.ERROR_MSG, syntax, message.replaceAll("[\\r\\n]+", " ").strip());
    }

    public String endError(CommentSyntax syntax, String displayPath) {
        return format(MarkerKind.END_ERROR, syntax, displayPath);
    }

    /**
     * Parses a bundle line, ignoring surrounding whitespace and its terminator.
     *
     * @return the marker, or empty when the line is payload
     */
    public Optional<Marker> recognize(String line) {
        String stripped = line.strip();
        if (!stripped.contains(SENTINEL)) {
            return Optional.empty();
        }
        Matcher m = MARKER_PATTERN.matcher(stripped);
        if (!m.matches()) {
            return Optional.empty();
        }
        return Optional.of(new Marker(
                MarkerKind.fromKeyword(m.group(2)),
                m.group(3),
                m.group(1),
                m.group(4) != null));
    }
}
