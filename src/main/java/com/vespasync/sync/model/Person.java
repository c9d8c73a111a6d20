package com.vespasync.sync.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * A tracked individual. Email is the natural key; {@code externalId} is the most recent source id.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Person implements Keyed {
    private UUID id;
    private String email;
    private String externalId;
    private String name;
    private UUID institutionId;
    private String groupName;
    private String yearGroup;
    private String course;
    private String faculty;
    private Integer currentCycle;
    private String currentPeriod;

    @Override
    public String naturalKey() {
        return email;
    }
}
