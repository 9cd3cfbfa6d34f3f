package com.pinclick.copilot.model;

public record Transition(FlowNode next, ResultWindowAction windowAction) {
}
