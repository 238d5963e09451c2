package com.iimsoft.planner.distribution;

import com.iimsoft.planner.domain.Assignment;
import com.iimsoft.planner.domain.Process;
import lombok.Value;

import java.util.List;

@Value
public class AllocationOutcome {
    List<Assignment> assignments;
    List<Process> unassigned;
    ResourceLedger ledger;
}
