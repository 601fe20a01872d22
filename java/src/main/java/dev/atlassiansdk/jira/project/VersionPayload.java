package dev.atlassiansdk.jira.project;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.LocalDate;

/**
 * Body of the create and update version calls. Unset fields are left out, so an update only touches what is given.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record VersionPayload(
    String name,
    String description,
    Long projectId,
    Boolean archived,
    Boolean released,
    LocalDate startDate,
    LocalDate releaseDate
) {

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String name;
        private String description;
        private Long projectId;
        private Boolean archived;
        private Boolean released;
        private LocalDate startDate;
        private LocalDate releaseDate;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder projectId(Long projectId) {
            this.projectId = projectId;
            return this;
        }

        public Builder archived(Boolean archived) {
            this.archived = archived;
            return this;
        }

        public Builder released(Boolean released) {
            this.released = released;
            return this;
        }

        public Builder startDate(LocalDate startDate) {
            this.startDate = startDate;
            return this;
        }

        public Builder releaseDate(LocalDate releaseDate) {
            this.releaseDate = releaseDate;
            return this;
        }

        public VersionPayload build() {
            return new VersionPayload(name, description, projectId, archived, released, startDate, releaseDate);
        }
    }
}
