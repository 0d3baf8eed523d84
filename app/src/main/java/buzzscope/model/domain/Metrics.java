package buzzscope.model.domain;

import java.time.Instant;
import java.util.List;

public record Metrics(
        long totalMentions,
        long uniqueAuthors,
        long totalInteractions,
        Bucket bucket,
        List<TrendPoint> trend,
        List<Contributor> topContributors,
        List<Post> samplePosts,
        List<PlatformSubtotal> perPlatform,
        Instant firstMention,
        Instant lastMention,
        TrendSummary summary
) {
    public Metrics {
        trend = List.copyOf(trend);
        topContributors = List.copyOf(topContributors);
        samplePosts = List.copyOf(samplePosts);
        perPlatform = List.copyOf(perPlatform);
    }
}
