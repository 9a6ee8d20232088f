package com.iimsoft.allocation.engine;

import com.iimsoft.allocation.domain.ConstrainingInput;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Output of {@link ConstraintResolver}: the committable limit and what bound it.
 */
@Getter
@ToString
@AllArgsConstructor
public class BuildLimit {
    private final long baseLimit;
    private final long reservedQty;
    private final long globalLimit;
    private final ConstrainingInput constrainingInput;
}
