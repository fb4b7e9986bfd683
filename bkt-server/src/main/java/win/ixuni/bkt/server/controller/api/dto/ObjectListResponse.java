package win.ixuni.bkt.server.controller.api.dto;

import win.ixuni.bkt.core.model.StoredObject;

import java.util.List;

public record ObjectListResponse(String bucket, String prefix, int maxKeys, int count, List<StoredObject> objects) {
}
