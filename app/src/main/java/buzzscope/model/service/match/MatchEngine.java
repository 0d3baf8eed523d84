package buzzscope.model.service.match;

import buzzscope.model.domain.MatchPolicy;
import buzzscope.model.domain.Post;

import java.util.List;
import java.util.Locale;

/** Keyword matching, applied the same way to every platform. */
public class MatchEngine {

    public boolean matches(String text, String keyword, MatchPolicy policy) {
        if (text == null || keyword == null || text.isEmpty() || keyword.isEmpty()) return false;
        String t = text.toLowerCase(Locale.ROOT);
        String k = keyword.toLowerCase(Locale.ROOT);
        return switch (policy) {
            case FUZZY -> t.contains(k);
            case EXACT -> containsBounded(t, k);
        };
    }

    public boolean matches(Post post, String keyword, MatchPolicy policy) {
        return matches(post.matchText(), keyword, policy);
    }

    public List<Post> filter(List<Post> posts, String keyword, MatchPolicy policy) {
        return posts.stream().filter(p -> matches(p, keyword, policy)).toList();
    }

    // "ai" in "said" fails at the first hit but may still match later in the text.
    private static boolean containsBounded(String text, String kw) {
        int from = 0;
        while (true) {
            int i = text.indexOf(kw, from);
            if (i < 0) return false;
            int end = i + kw.length();
            boolean left = i == 0 || !Character.isLetterOrDigit(text.charAt(i - 1));
            boolean right = end == text.length() || !Character.isLetterOrDigit(text.charAt(end));
            if (left && right) return true;
            from = i + 1;
        }
    }
}
