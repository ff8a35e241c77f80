package com.awesomeposter.core.hitl;

import java.io.Serializable;

public record HitlOption(String id, String label, String description) implements Serializable {
}
