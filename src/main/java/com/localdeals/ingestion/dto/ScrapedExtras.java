package com.localdeals.ingestion.dto;

import lombok.Getter;
import lombok.ToString;

import java.util.List;

@Getter
@ToString
public class ScrapedExtras {

    private final String description;
    private final List<String> menuLinks;

    public ScrapedExtras(String description, List<String> menuLinks) {
        this.description = description;
        this.menuLinks = menuLinks != null ? List.copyOf(menuLinks) : List.of();
    }
}
