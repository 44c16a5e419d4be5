package net.neoforged.lct.api;

public enum ProblemSeverity {
    WARNING,
    ERROR
}
