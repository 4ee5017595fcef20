package com.gt.lse.interaction;

import com.gt.lse.model.InteractionResponse;
import com.gt.lse.model.SessionContext;

public record InteractionResult(SessionContext context, InteractionResponse response) { }
