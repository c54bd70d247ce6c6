package com.chainfeed.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;

/**
 * Which smart contracts a subscriber reads. Empty lists match everything for that dimension.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode
@ToString
public class TopicFilter {

    private List<String> organizations = new ArrayList<>();
    private List<String> projects = new ArrayList<>();
    private List<String> networkIds = new ArrayList<>();
    private List<String> groups = new ArrayList<>();
    private List<String> smartcontracts = new ArrayList<>();

    @JsonIgnore
    public boolean isEmpty() {
        return organizations.isEmpty() && projects.isEmpty() && networkIds.isEmpty()
                && groups.isEmpty() && smartcontracts.isEmpty();
    }
}
