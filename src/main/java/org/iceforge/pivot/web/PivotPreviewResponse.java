package org.iceforge.pivot.web;

import java.util.List;

public record PivotPreviewResponse(String sql, List<String> columns, List<String> measures) {
}
