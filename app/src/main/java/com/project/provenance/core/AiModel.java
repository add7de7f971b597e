package com.project.provenance.core;

import com.project.provenance.eth.Principal;

/**
 * Trusted AI attribution model.
 *
 * @param modelId         unique identifier, at most 64 bytes.
 * @param name            display name.
 * @param version         version string.
 * @param registeredBy    principal that registered the model (always the registry owner).
 * @param confidenceLevel published confidence in [70, 100].
 * @param active          whether assets may reference the model.
 */
public record AiModel(
        String modelId,
        String name,
        String version,
        Principal registeredBy,
        int confidenceLevel,
        boolean active
) {
}
