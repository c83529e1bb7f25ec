package org.iceforge.pivot.web;

import java.util.List;

public record SchemaUploadResponse(List<String> cubes, String message) {
}
