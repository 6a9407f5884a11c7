package com.sourcebundler.core.content;

import com.sourcebundler.core.config.BundlerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Decodes a file's bytes to text by trying each configured encoding in order.
 * <p>
 * An encoding is accepted only if it decodes without error and the result does
 * not look binary. The binary check is a heuristic: it samples the start of the
 * decoded text and rejects it when too many code points are neither printable
 * nor tab, line feed, form feed or carriage return. Text dense in rare code
 * points can be misclassified, and mostly-printable binary can slip through.
 */
@Service
public class ContentLoader {

    private static final Logger log = LoggerFactory.getLogger(ContentLoader.class);

    private final List<Charset> encodings;
    private final int sampleSize;
    private final double maxNonPrintableRatio;

    @Autowired
    public ContentLoader(BundlerProperties properties) {
        this(properties.getEncodings().stream().map(Charset::forName).toList(),
                properties.getBinary().getSampleSize(),
                properties.getBinary().getMaxNonPrintableRatio());
    }

    public ContentLoader(List<Charset> encodings, int sampleSize, double maxNonPrintableRatio) {
        if (encodings.isEmpty()) {
            throw new IllegalArgumentException("At least one encoding is required");
        }
        this.encodings = List.copyOf(encodings);
        this.sampleSize = sampleSize;
        this.maxNonPrintableRatio = maxNonPrintableRatio;
    }

    /**
     * Reads and decodes a file.
     *
     * @return the decoded text, line terminators untouched
     * @throws ContentDecodeException if every encoding fails or yields binary-looking text
     * @throws IOException            if the file cannot be read
     */
    public String read(Path file) throws IOException {
        byte[] bytes = Files.readAllBytes(file);
        for (Charset charset : encodings) {
            String text;
            try {
                text = charset.newDecoder()
                        .onMalformedInput(CodingErrorAction.REPORT)
                        .onUnmappableCharacter(CodingErrorAction.REPORT)
                        .decode(ByteBuffer.wrap(bytes))
                        .toString();
            } catch (CharacterCodingException e) {
                log.debug("{} is not valid {}", file, charset.name());
                continue;
            }
            if (looksBinary(text)) {
                log.debug("{} looks binary when decoded as {}", file, charset.name());
                continue;
            }
            return text;
        }
        throw new ContentDecodeException(file);
    }

    /**
     * Returns {@code true} if more than the allowed share of the sampled code
     * points are non-printable.
     */
    public boolean looksBinary(String text) {
        String sample = text.length() > sampleSize ? text.substring(0, sampleSize) : text;
        int total = 0;
        int nonPrintable = 0;
        for (int i = 0; i < sample.length(); ) {
            int cp = sample.codePointAt(i);
            i += Character.charCount(cp);
            total++;
            if (!isPrintable(cp) && cp != '\t' && cp != '\n' && cp != '\f' && cp != '\r') {
                nonPrintable++;
            }
        }
        return nonPrintable > total * maxNonPrintableRatio;
    }

    static boolean isPrintable(int codePoint) {
        if (codePoint == ' ') {
            return true;
        }
        return switch (Character.getType(codePoint)) {
            case Character.CONTROL, Character.FORMAT, Character.SURROGATE, Character.PRIVATE_USE,
                 Character.UNASSIGNED, Character.LINE_SEPARATOR, Character.PARAGRAPH_SEPARATOR,
                 Character.SPACE_SEPARATOR -> false;
            default -> true;
        };
    }
}
