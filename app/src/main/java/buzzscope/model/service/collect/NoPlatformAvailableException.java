package buzzscope.model.service.collect;

import buzzscope.model.domain.CollectionResult;

/** Every requested platform failed. The result still lists why, per platform. */
public class NoPlatformAvailableException extends CollectionException {
    private final transient CollectionResult result;

    public NoPlatformAvailableException(CollectionResult result) {
        super("no platform available for '" + result.keyword().normalized() + "': " + reasons(result));
        this.result = result;
    }

    public CollectionResult result() { return result; }

    private static String reasons(CollectionResult r) {
        StringBuilder sb = new StringBuilder("[");
        r.platforms().values().forEach(p -> {
            if (sb.length() > 1) sb.append(", ");
            sb.append(p.platform().id()).append('=').append(p.error()).append(' ').append(p.reason());
        });
        return sb.append(']').toString();
    }
}
