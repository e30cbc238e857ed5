package skillcron.cron.runner;

/**
 * Looks up the unit of work a job points at.
 */
public interface TargetResolver {

    /**
     * @param id target id
     * @return the target, or null if no such target exists
     */
    Target loadTargetById(String id);
}
