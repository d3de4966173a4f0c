package dev.postify.model;

/**
 * What a publisher returns for a delivered post. The external id may be null
 * (console, dry run).
 */
public record PublishReceipt(String platform, String externalId) {
}
