package com.gentoro.labasset.record;

import java.util.List;

public record RecordSummary(
    String externalId, String title, int categoryId, List<String> tags, String date) {}
