/* (c) 2014 LinkedIn Corp. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not use
 * this file except in compliance with the License. You may obtain a copy of the
 * License at  http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software distributed
 * under the License is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR
 * CONDITIONS OF ANY KIND, either express or implied.
 */

package com.linkedin.datacube;

/**
 * Thrown when an index hierarchy, a dimension or a build configuration is rejected at
 * construction time. These failures are never retried.
 *
 * @see CubeDefinitionErrorType
 */
public class CubeDefinitionException extends IllegalArgumentException
{
    private static final long serialVersionUID = -3925180643315520417L;
    private final CubeDefinitionErrorType errorType;

    public CubeDefinitionException(CubeDefinitionErrorType errorType, String message)
    {
        super(message);
        this.errorType = errorType;
    }

    public CubeDefinitionException(CubeDefinitionErrorType errorType,
                                   String message,
                                   Throwable cause)
    {
        super(message, cause);
        this.errorType = errorType;
    }

    public CubeDefinitionErrorType getErrorType()
    {
        return errorType;
    }

    @Override
    public String toString()
    {
        StringBuilder builder = new StringBuilder();
        builder.append("CubeDefinitionException [")
               .append(errorType)
               .append("] ")
               .append(getMessage());
        return builder.toString();
    }
}
