package com.vespasync.sync.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Row of one of the auxiliary role tables (staff admins, super users).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StaffMember implements Keyed {
    private String externalId;
    private String email;
    private String name;
    private UUID institutionId;
    private String institutionName;

    @Override
    public String naturalKey() {
        return externalId;
    }
}
