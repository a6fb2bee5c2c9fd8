package com.al.hl7siu.parser;

import com.al.hl7siu.util.Hl7TextUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a file or request body holding several concatenated HL7 messages.
 *
 * <p>
 * Every segment line starting with {@code MSH} opens a new message, which runs
 * up to the line before the next {@code MSH} (or the end of input). Blank lines
 * are dropped and line endings are normalized to {@code \r} first.
 */
@Component
@Slf4j
public class Hl7MessageSplitter {

    public static final String HEADER_SEGMENT = "MSH";

    /**
     * @param raw blob of one or more messages
     * @return message texts, each starting with MSH and ending with {@code \r};
     *         empty when the blob has no MSH segment
     */
    public List<String> split(String raw) {
        List<String> lines = Hl7TextUtil.segmentLines(raw);

        List<Integer> headerIndexes = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            if (lines.get(i).startsWith(HEADER_SEGMENT)) {
                headerIndexes.add(i);
            }
        }
        if (headerIndexes.isEmpty()) {
            log.debug("No MSH segment found in {} segment lines", lines.size());
            return List.of();
        }

        List<String> messages = new ArrayList<>(headerIndexes.size());
        for (int i = 0; i < headerIndexes.size(); i++) {
            int start = headerIndexes.get(i);
            int end = i + 1 < headerIndexes.size() ? headerIndexes.get(i + 1) : lines.size();
            StringBuilder sb = new StringBuilder();
            for (String line : lines.subList(start, end)) {
                sb.append(line).append(Hl7TextUtil.SEGMENT_DELIMITER);
            }
            messages.add(sb.toString());
        }
        log.debug("Split input into {} HL7 messages", messages.size());
        return messages;
    }
}
