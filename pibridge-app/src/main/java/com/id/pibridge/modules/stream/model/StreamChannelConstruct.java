package com.id.pibridge.modules.stream.model;

/**
 * What the push-delivery side needs to re-poll a result: the stream WebID and its interval.
 */
public record StreamChannelConstruct(String webId, long intervalNanoSeconds) {
}
