package com.itguru.api.dto;

import java.util.List;

public record FollowupResponse(String sessionId, List<String> followups) {}
