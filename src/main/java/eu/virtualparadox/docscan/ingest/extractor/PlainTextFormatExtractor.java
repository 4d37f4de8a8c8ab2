package eu.virtualparadox.docscan.ingest.extractor;

import eu.virtualparadox.docscan.ingest.model.DocumentKind;
import eu.virtualparadox.docscan.ingest.model.Page;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Plain-text and source files, decoded as UTF-8. Any byte sequence is accepted:
 * malformed or unmappable input is replaced with U+FFFD rather than rejected.
 */
@Component
public final class PlainTextFormatExtractor implements FormatExtractor {

    @Override
    public DocumentKind kind() {
        return DocumentKind.PLAIN_TEXT;
    }

    @Override
    public List<Page> extractPages(final Path path) throws IOException {
        return List.of(Page.single(decode(Files.readAllBytes(path))));
    }

    static String decode(final byte[] bytes) throws CharacterCodingException {
        final CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE);
        return decoder.decode(ByteBuffer.wrap(bytes)).toString();
    }
}
