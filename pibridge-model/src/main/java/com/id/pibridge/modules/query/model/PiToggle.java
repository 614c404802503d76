package com.id.pibridge.modules.query.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PiToggle {

    private boolean enable;

    public static PiToggle on() {
        return new PiToggle(true);
    }

    public static PiToggle off() {
        return new PiToggle(false);
    }
}
