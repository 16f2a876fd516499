package br.com.coursesync.api.model.enums;

public enum ProcessingMode {
    BEST_EFFORT, // Continua após falhas individuais e devolve as operações que falharam
    STRICT       // Aborta (e desfaz) o lote inteiro na primeira falha
}
