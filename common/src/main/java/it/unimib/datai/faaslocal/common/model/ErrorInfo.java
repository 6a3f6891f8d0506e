package it.unimib.datai.faaslocal.common.model;

public record ErrorInfo(String code, String message) {
}
