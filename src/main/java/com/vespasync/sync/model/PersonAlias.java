package com.vespasync.sync.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PersonAlias implements Keyed {
    private String externalId;
    private UUID personId;

    @Override
    public String naturalKey() {
        return externalId;
    }
}
