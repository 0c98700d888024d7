package com.example.RagChat.model;

public enum Direction {
    INPUT,
    OUTPUT
}
