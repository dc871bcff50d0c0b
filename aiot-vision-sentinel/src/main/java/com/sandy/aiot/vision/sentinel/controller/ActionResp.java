package com.sandy.aiot.vision.sentinel.controller;

import lombok.Data;

@Data
public class ActionResp {
    private boolean success;
    private String message;

    public static ActionResp ok() { ActionResp r = new ActionResp(); r.success = true; return r; }
    public static ActionResp ok(String msg) { ActionResp r = ok(); r.message = msg; return r; }
    public static ActionResp fail(String msg) { ActionResp r = new ActionResp(); r.success = false; r.message = msg; return r; }
}
