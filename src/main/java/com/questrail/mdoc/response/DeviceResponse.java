package com.questrail.mdoc.response;

import java.util.List;

/**
 * Result of {@link DeviceResponseParser#parse}.
 */
public record DeviceResponse(
    String version,
    int status,
    List<MdocDocument> documents,
    List<VerifiedZkDocument> zkDocuments
) {
    public DeviceResponse {
        documents = List.copyOf(documents);
        zkDocuments = List.copyOf(zkDocuments);
    }
}
