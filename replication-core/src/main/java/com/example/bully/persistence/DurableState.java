package com.example.bully.persistence;

import java.util.ArrayList;
import java.util.List;

import com.example.bully.model.Commit;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Everything a replica persists: the commit sequence and the applier state
 * produced by applying exactly those commits. Written as one unit.
 * {@code haltReason} is set once the log met a diverging commit; it is
 * never cleared.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DurableState {
    private List<Commit> commits = new ArrayList<>();
    private String applierSnapshot;
    private String haltReason;

    public DurableState(List<Commit> commits, String applierSnapshot) {
        this(commits, applierSnapshot, null);
    }

    public static DurableState empty() {
        return new DurableState(new ArrayList<>(), null);
    }
}
