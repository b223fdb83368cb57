package com.nevis.chat.repository;

import com.nevis.chat.model.Passage;

import java.util.List;

public interface PassageSource {

    List<Passage> loadAll();

    String location();
}
