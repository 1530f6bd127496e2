package com.example.pawnsim.content;

public interface ContentDef {

    int getId();

    void setId(int id);

    String getName();
}
