package dev.postify.model;

/**
 * Outcome of one platform publish inside an approve decision.
 */
public record PlatformResult(
        String platform,
        Outcome outcome,
        String externalId,
        String error) {

    public enum Outcome {
        PUBLISHED,
        ALREADY_PUBLISHED,
        FAILED
    }

    public static PlatformResult published(String platform, String externalId) {
        return new PlatformResult(platform, Outcome.PUBLISHED, externalId, null);
    }

    public static PlatformResult alreadyPublished(String platform) {
        return new PlatformResult(platform, Outcome.ALREADY_PUBLISHED, null, null);
    }

    public static PlatformResult failed(String platform, String error) {
        return new PlatformResult(platform, Outcome.FAILED, null, error);
    }

    public boolean isSuccess() {
        return outcome != Outcome.FAILED;
    }
}
