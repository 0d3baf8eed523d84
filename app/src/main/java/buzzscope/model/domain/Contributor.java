package buzzscope.model.domain;

import java.time.Instant;

public record Contributor(String author, long mentions, Instant firstMention, long interactions) {}
