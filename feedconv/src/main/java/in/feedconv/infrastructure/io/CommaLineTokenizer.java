package in.feedconv.infrastructure.io;

import in.feedconv.application.port.output.LineTokenizer;

import java.util.Arrays;
import java.util.List;

/**
 * Comma tokenizer for vendor CSV rows.
 *
 * Keeps empty and trailing fields so column positions stay aligned with the header.
 * Quote characters are not interpreted and stay part of the field.
 */
public final class CommaLineTokenizer implements LineTokenizer {

    @Override
    public List<String> tokenize(String line) {
        if (line == null || line.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(line.split(",", -1));  // -1 to keep trailing empty strings
    }
}
