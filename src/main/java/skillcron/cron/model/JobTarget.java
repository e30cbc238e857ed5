package skillcron.cron.model;

/**
 * What a job runs.
 *
 * @param kind      target kind
 * @param targetId  skill id
 * @param query     prompt handed to the skill
 * @param profileId optional execution profile, may be null
 */
public record JobTarget(TargetKind kind, String targetId, String query, String profileId) {

    public JobTarget {
        if (kind == null) {
            kind = TargetKind.SKILL;
        }
        if (query == null) {
            query = "";
        }
    }

    public static JobTarget skill(String targetId, String query) {
        return new JobTarget(TargetKind.SKILL, targetId, query, null);
    }
}
