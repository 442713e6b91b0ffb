package com.nevis.notebook.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.nevis.notebook.model.AnswerPath;
import com.nevis.notebook.model.ChatAnswer;

public record AnswerResponse(
    @JsonProperty("user_turn")
    TurnResponse userTurn,

    @JsonProperty("assistant_turn")
    TurnResponse assistantTurn,

    AnswerPath path
) {
    static AnswerResponse from(ChatAnswer answer) {
        return new AnswerResponse(
            TurnResponse.from(answer.userTurn()),
            TurnResponse.from(answer.assistantTurn()),
            answer.path());
    }
}
