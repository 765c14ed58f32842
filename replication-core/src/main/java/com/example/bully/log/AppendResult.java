package com.example.bully.log;

import com.example.bully.model.Commit;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@AllArgsConstructor
@ToString
public class AppendResult {
    private final Commit commit;
    private final String result; // what the state applier returned for the command
}
