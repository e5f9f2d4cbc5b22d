package com.questrail.mdoc.zkp;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Registry of {@link ZkSystem}s keyed by name. Passed explicitly to whoever
 * proves or verifies.
 */
public final class ZkSystemRepository
{
    private final Map<String, ZkSystem> systems = new LinkedHashMap<>();

    public synchronized ZkSystemRepository add(ZkSystem system) {
        Objects.requireNonNull(system, "system");
        systems.put(system.name(), system);
        return this;
    }

    public synchronized Optional<ZkSystem> lookup(String name) {
        return Optional.ofNullable(systems.get(name));
    }

    /**
     * Finds the first requested spec a registered system can serve.
     *
     * @return the local spec matching it
     */
    public synchronized Optional<ZkSystemSpec> findMatchingSpec(List<ZkSystemSpec> requested) {
        for (ZkSystemSpec wanted : requested) {
            ZkSystem system = systems.get(wanted.system());
            if (system == null) {
                continue;
            }
            for (ZkSystemSpec own : system.systemSpecs()) {
                if (own.matches(wanted)) {
                    return Optional.of(own);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Verifies {@code document} with the system whose spec id the document names.
     *
     * @throws ProofSystemNotFoundException if no registered system has that spec
     * @throws ProofVerificationException   if the proof does not verify
     */
    public void verify(ZkDocument document, byte[] sessionTranscript) {
        String specId = document.documentData().zkSystemSpecId();
        ZkSystem system = null;
        ZkSystemSpec spec = null;
        synchronized (this) {
            for (ZkSystem candidate : systems.values()) {
                for (ZkSystemSpec s : candidate.systemSpecs()) {
                    if (s.id().equals(specId)) {
                        system = candidate;
                        spec = s;
                        break;
                    }
                }
                if (system != null) {
                    break;
                }
            }
        }
        if (system == null) {
            throw new ProofSystemNotFoundException("No ZK system for spec id " + specId);
        }
        system.verifyProof(document, spec, sessionTranscript);
    }
}
