package macrogate.hierarchy;

/**
 * Summary figures of one analysis.
 *
 * <p>{@code dagNodes} counts operations plus an input and an output node per wire; {@code dagEdges}
 * counts one wire segment per qubit entering each operation plus the closing segment of every wire.
 */
public record CircuitStatistics(
    int originalGateCount,
    int hierarchicalItemCount,
    double compressionRatio,
    int numMacros,
    int totalMacroInstances,
    int circuitDepth,
    int numQubits,
    int dagNodes,
    int dagEdges) {}
