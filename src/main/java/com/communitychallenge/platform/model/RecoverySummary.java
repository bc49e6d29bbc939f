package com.communitychallenge.platform.model;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class RecoverySummary {
    private int resumed;
    private int claimed;

    public boolean hasWork() {
        return resumed > 0 || claimed > 0;
    }
}
