package com.example.redline.web;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
public class AnalyzeTextRequest {
    private String name;
    private String text;
}
