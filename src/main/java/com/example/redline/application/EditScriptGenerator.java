package com.example.redline.application;

import com.example.redline.domain.EditScript;

public interface EditScriptGenerator {
    EditScript diff(String original, String amended);
}
