package in.feedconv.application.port.output;

import java.util.List;

/**
 * Splits one delimited text line into its ordered fields.
 */
public interface LineTokenizer {
    List<String> tokenize(String line);
}
