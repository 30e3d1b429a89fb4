package com.purchasingpower.workgraph.util;

import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.HexFormat;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Generates identifiers that stay unique across threads, processes and hosts.
 *
 * <p>Format: {@code <prefix>_<epochMillis>_<machineId>_<pidHex>_<sequence6>_<random8hex>},
 * for example {@code node_1718000000000_a1b2c3_3f2a_000042_9c0ffee1}.
 *
 * @since 1.0.0
 */
@Component
public class IdGenerator {

    private static final int MAX_SEQUENCE = 999_999;

    private final SecureRandom random = new SecureRandom();
    private final AtomicInteger sequence = new AtomicInteger();
    private final String machineId;
    private final String processId;

    public IdGenerator() {
        this(System.getenv("MACHINE_ID"));
    }

    IdGenerator(String configuredMachineId) {
        this.machineId = configuredMachineId != null && !configuredMachineId.isBlank()
            ? configuredMachineId
            : randomHex(3);
        this.processId = Long.toHexString(ProcessHandle.current().pid());
    }

    public String generateNodeId() {
        return generate("node");
    }

    public String generateEdgeId() {
        return generate("edge");
    }

    public String generateGraphId() {
        return generate("graph");
    }

    private String generate(String prefix) {
        int seq = sequence.updateAndGet(current -> (current + 1) % MAX_SEQUENCE);
        return String.format("%s_%d_%s_%s_%06d_%s",
            prefix, System.currentTimeMillis(), machineId, processId, seq, randomHex(4));
    }

    private String randomHex(int bytes) {
        byte[] buffer = new byte[bytes];
        random.nextBytes(buffer);
        return HexFormat.of().formatHex(buffer);
    }

    /**
     * Returns every ID that appears more than once, in first-seen order.
     */
    public static List<String> detectIdCollisions(Collection<String> ids) {
        Set<String> seen = new HashSet<>();
        Set<String> duplicates = new LinkedHashSet<>();
        for (String id : ids) {
            if (!seen.add(id)) {
                duplicates.add(id);
            }
        }
        return new ArrayList<>(duplicates);
    }
}
