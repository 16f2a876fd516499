package br.com.coursesync.api.service.sync.strategy;

import br.com.coursesync.api.dto.change.ChangeOperation;

/**
 * Aplica um tipo de operação (CREATE, UPDATE ou DELETE) no banco.
 */
public interface ChangeStrategy {

    /**
     * @param change a operação a aplicar
     * @return true se aplicada; false se a combinação operação/entidade não é suportada
     * @throws br.com.coursesync.api.exception.ResourceNotFoundException se a entidade referenciada não existe
     * @throws br.com.coursesync.api.exception.InvalidChangeDataTypeException se o payload não corresponde à entidade
     */
    boolean process(ChangeOperation change);
}
