package buzzscope.model.domain;

import buzzscope.collector.core.Platform;

public record PlatformSubtotal(Platform platform, long mentions, long uniqueAuthors, long interactions) {}
