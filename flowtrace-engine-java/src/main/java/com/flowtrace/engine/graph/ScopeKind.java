package com.flowtrace.engine.graph;

public enum ScopeKind { MODULE, CLASS, FUNCTION }
