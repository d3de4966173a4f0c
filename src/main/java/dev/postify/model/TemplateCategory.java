package dev.postify.model;

/**
 * Content category of a post template. The first three make up the 4-1-1
 * cycle; ANNOUNCEMENT templates are only used for upgrade announcements.
 */
public enum TemplateCategory {
    EDUCATIONAL,
    SOFT_SELL,
    HARD_SELL,
    ANNOUNCEMENT;

    public boolean isRotation() {
        return this != ANNOUNCEMENT;
    }
}
