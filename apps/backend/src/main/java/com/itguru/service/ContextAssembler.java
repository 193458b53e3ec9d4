package com.itguru.service;

import com.itguru.ai.ChatTurn;
import com.itguru.api.dto.EnhancedContext;
import com.itguru.api.dto.InjectionCheck;
import com.itguru.api.dto.QueryType;

import java.util.List;

public interface ContextAssembler {

    QueryType classifyQueryType(String query);

    /**
     * Guarded message set for the answer completion: role prompt, guardrails,
     * context block, then the user query (wrapped when injection heuristics fired).
     */
    List<ChatTurn> buildMessages(String query, String history, EnhancedContext context, InjectionCheck injection);
}
