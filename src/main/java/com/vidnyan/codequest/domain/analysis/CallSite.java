package com.vidnyan.codequest.domain.analysis;

/**
 * A call expression found in an entity body: the bare callee name and its line.
 */
public record CallSite(String calleeName, int line) {}
