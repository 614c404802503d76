package com.id.pibridge.modules.stream.rest;

import com.id.pibridge.modules.stream.model.PiStreamChannel;
import com.id.pibridge.modules.stream.service.StreamChannelRegistry;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

@RestController
@RequestMapping("pibridge/channels")
public class ChannelsRest {

    private final StreamChannelRegistry streamChannelRegistry;

    public ChannelsRest(StreamChannelRegistry streamChannelRegistry) {
        this.streamChannelRegistry = streamChannelRegistry;
    }

    @GetMapping("{channelId}")
    public PiStreamChannel getChannel(@PathVariable("channelId") String channelId) {
        return streamChannelRegistry.find(channelId)
                .map(construct -> new PiStreamChannel(channelId, construct.webId(), construct.intervalNanoSeconds()))
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Channel not found: " + channelId));
    }
}
