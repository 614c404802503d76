package com.id.pibridge.modules.stream.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PiStreamChannel {

    private String channelId;
    private String webId;
    private long intervalNanoSeconds;

}
