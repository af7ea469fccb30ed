package com.gitcli.parse;

public interface OutputParser<T> {
    T parse(String output);
}
