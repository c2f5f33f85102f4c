package io.github.yok.evselink.feed;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;
import io.github.yok.evselink.core.ImportException;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Reads an EVSE data feed from a JSON file.
 *
 * <p>
 * The feed is usually produced by an XML-to-JSON conversion, so a list containing exactly one
 * element may appear as a bare object and an empty element as an empty string. Both are
 * accepted. Unknown properties are ignored.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
public class FeedReader {

    private final ObjectMapper mapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true)
            .configure(DeserializationFeature.ACCEPT_EMPTY_STRING_AS_NULL_OBJECT, true);

    /**
     * Parses the feed file.
     *
     * @param feedFile JSON feed file
     * @return parsed feed
     * @throws NullPointerException if {@code feedFile} is {@code null}
     * @throws ImportException if the file is missing or is not a valid feed
     */
    public FeedRoot read(Path feedFile) {
        Preconditions.checkNotNull(feedFile, "feedFile must not be null");
        if (!Files.isRegularFile(feedFile)) {
            throw new ImportException("Feed file does not exist: " + feedFile.toAbsolutePath());
        }
        try (Reader reader = Files.newBufferedReader(feedFile, StandardCharsets.UTF_8)) {
            FeedRoot root = mapper.readValue(reader, FeedRoot.class);
            log.info("Feed loaded: {} (operators={})", feedFile.getFileName(),
                    root.operatorBlocks().size());
            return root;
        } catch (IOException e) {
            throw new ImportException("Failed to read feed: " + feedFile.toAbsolutePath(), e);
        }
    }
}
