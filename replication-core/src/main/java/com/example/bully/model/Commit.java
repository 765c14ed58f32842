package com.example.bully.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One immutable entry of the commit log.
 * Ids start at 1 and are contiguous on every replica.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Commit {
    private long id;
    private String command; // opaque payload handed to the state applier
}
