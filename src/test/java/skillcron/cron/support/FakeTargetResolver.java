package skillcron.cron.support;

import skillcron.cron.runner.Target;
import skillcron.cron.runner.TargetResolver;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

public final class FakeTargetResolver implements TargetResolver {

    private final Set<String> known = ConcurrentHashMap.newKeySet();

    public FakeTargetResolver(String... ids) {
        known.addAll(Set.of(ids));
    }

    @Override
    public Target loadTargetById(String id) {
        return known.contains(id) ? new Target(id, id, null) : null;
    }
}
