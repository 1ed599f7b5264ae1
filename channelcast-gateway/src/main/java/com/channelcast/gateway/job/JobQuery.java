package com.channelcast.gateway.job;

import lombok.Builder;

import java.util.Comparator;

/**
 * Filter, sort and limit for {@link JobStore#find(JobQuery)}.
 *
 * @param enabled     only jobs with this enabled flag; {@code null} for any
 * @param contentType only jobs with this content type; {@code null} for any
 * @param sort        result order
 * @param limit       maximum results; {@code 0} for no limit
 */
@Builder
public record JobQuery(Boolean enabled, String contentType, Sort sort, int limit) {

    public enum Sort {
        CREATED_DESC, CREATED_ASC, NAME
    }

    public static JobQuery all() {
        return new JobQuery(null, null, Sort.CREATED_ASC, 0);
    }

    public boolean matches(JobDefinition job) {
        if (enabled != null && job.isEnabled() != enabled) {
            return false;
        }
        return contentType == null || contentType.equals(job.getContentType());
    }

    public Comparator<JobDefinition> comparator() {
        Comparator<JobDefinition> byCreated = Comparator.comparing(JobDefinition::getCreatedAt,
                Comparator.nullsFirst(Comparator.naturalOrder()));
        Comparator<JobDefinition> byId = Comparator.comparing(JobDefinition::getId);
        if (sort == null) {
            return byCreated.thenComparing(byId);
        }
        switch (sort) {
            case CREATED_DESC:
                return byCreated.reversed().thenComparing(byId);
            case NAME:
                return Comparator.comparing(JobDefinition::getName,
                        Comparator.nullsFirst(String.CASE_INSENSITIVE_ORDER)).thenComparing(byId);
            default:
                return byCreated.thenComparing(byId);
        }
    }
}
