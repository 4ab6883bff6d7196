package com.perptrader.backend.service.decision;

import lombok.Value;

@Value
public class CompiledPrompt {
    String systemPrompt;
    String userPrompt;
}
