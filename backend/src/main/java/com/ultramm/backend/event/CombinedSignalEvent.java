package com.ultramm.backend.event;

import com.ultramm.backend.model.CombinedSignal;

public record CombinedSignalEvent(CombinedSignal signal) {}
