package com.vespasync.sync.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Institution implements Keyed {
    private UUID id;
    private String externalId;
    private String name;
    private String status;
    private boolean usesCalendarYear;

    @Override
    public String naturalKey() {
        return externalId;
    }
}
