package com.landregistry.applications;

/**
 * Kind of claim an application makes over a parcel.
 *
 * Each type carries its standard processing time in days and the number of days
 * shaved off that estimate for priority levels 1 to 5.
 */
public enum ApplicationType {
    REGISTRATION(30, new int[]{0, 10, 20, 25, 28}),
    TRANSFER(21, new int[]{0, 7, 14, 18, 20}),
    SUBDIVISION(45, new int[]{0, 15, 25, 35, 40}),
    MUTATION(14, new int[]{0, 5, 9, 12, 13});

    private final int standardProcessingDays;
    private final int[] priorityReductions;

    ApplicationType(int standardProcessingDays, int[] priorityReductions) {
        this.standardProcessingDays = standardProcessingDays;
        this.priorityReductions = priorityReductions;
    }

    public int getStandardProcessingDays() {
        return standardProcessingDays;
    }

    /**
     * Estimated processing time for an application of this type at the given priority (1-5).
     */
    public int estimatedProcessingDays(int priority) {
        if (priority < 1 || priority > priorityReductions.length) {
            throw new IllegalArgumentException("Priority must be between 1 and "
                + priorityReductions.length + ": " + priority);
        }
        return standardProcessingDays - priorityReductions[priority - 1];
    }
}
